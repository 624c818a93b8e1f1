package net.contentseo.controller.support;

import java.util.HashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(message, detail));
    }

    public static ResponseEntity<Map<String, String>> badRequest(String message, String detail) {
        return error(HttpStatus.BAD_REQUEST, message, detail);
    }

    /**
     * Builds a 400 payload that also names the invalid input field.
     */
    public static ResponseEntity<Map<String, String>> invalidField(String message, String detail, String field) {
        ResponseEntity<Map<String, String>> response = badRequest(message, detail);
        response.getBody().put("field", field);
        return response;
    }
}
