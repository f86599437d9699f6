package quest.gekko.aspath.web.exception;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.aspath.service.core.NotFoundException;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        log.debug("Not found: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return Map.of("detail", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return Map.of("detail", "Invalid value for " + ex.getName() + ": " + ex.getValue());
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Store unavailable for URL: {}", request.getRequestURL(), ex);
        return Map.of("detail", "Storage unavailable");
    }

    // unknown paths, unsupported methods and other MVC errors keep their own status
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<Map<String, String>> handleFrameworkError(Exception ex, HttpServletRequest request) {
        if (!(ex instanceof ErrorResponse)) {
            return ResponseEntity.internalServerError().body(handleGeneralException(ex, request));
        }
        ErrorResponse error = (ErrorResponse) ex;
        log.warn("{} {} for URL: {}", error.getStatusCode().value(), ex.getMessage(), request.getRequestURL());
        String detail = error.getBody().getDetail();
        return ResponseEntity.status(error.getStatusCode())
                .headers(error.getHeaders())
                .body(Map.of("detail", detail != null ? detail : String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, String> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return Map.of("detail", "An unexpected error occurred");
    }
}
