package quest.gekko.aspath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AspathApplication {

    public static void main(String[] args) {
        SpringApplication.run(AspathApplication.class, args);
    }

}
