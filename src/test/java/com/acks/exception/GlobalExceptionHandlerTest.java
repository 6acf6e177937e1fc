package com.acks.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should return 404 NOT_FOUND with the kind for NotFoundException")
    void shouldHandle404ForNotFound() {
        var ex = NotFoundException.of("Map", "nowhere");

        ResponseEntity<Map<String, String>> response = handler.handleCampaign(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Map not found: nowhere", response.getBody().get("error"));
        assertEquals("NOT_FOUND", response.getBody().get("kind"));
    }

    @Test
    @DisplayName("should return 409 CONFLICT for illegal actions and revision conflicts")
    void shouldHandle409ForConflicts() {
        assertEquals(HttpStatus.CONFLICT,
                handler.handleCampaign(new IllegalActionException("It is not Brannoc's turn")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT,
                handler.handleCampaign(new ConcurrencyConflictException("Map warren is at revision 4")).getStatusCode());
    }

    @Test
    @DisplayName("should return 400 BAD_REQUEST for ValidationException")
    void shouldHandle400ForValidation() {
        ResponseEntity<Map<String, String>> response = handler.handleCampaign(new ValidationException("Missing attackRoll"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("VALIDATION_ERROR", response.getBody().get("kind"));
    }

    @Test
    @DisplayName("should return 503 SERVICE_UNAVAILABLE for PersistenceFailureException")
    void shouldHandle503ForPersistenceFailure() {
        var ex = new PersistenceFailureException("Could not persist map warren", new RuntimeException("disk full"));

        ResponseEntity<Map<String, String>> response = handler.handleCampaign(ex);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("PERSISTENCE_FAILURE", response.getBody().get("kind"));
    }

    @Test
    @DisplayName("should return 400 BAD_REQUEST for IllegalArgumentException")
    void shouldHandle400ForIllegalArgument() {
        var ex = new IllegalArgumentException("No enum constant ActionType.DANCE");

        ResponseEntity<Map<String, String>> response = handler.handleIllegalArgument(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("No enum constant ActionType.DANCE", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 500 INTERNAL_SERVER_ERROR without details for generic Exception")
    void shouldHandle500ForGenericException() {
        var ex = new NullPointerException("some null value");

        ResponseEntity<Map<String, String>> response = handler.handleGeneral(ex);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("error"),
                "Should not leak exception details to client");
    }

    @Test
    @DisplayName("should return 400 with field errors for MethodArgumentNotValidException")
    @SuppressWarnings("unchecked")
    void shouldHandle400ForValidationErrors() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "combatants", "must not be empty"));
        bindingResult.addError(new FieldError("request", "treasureValue", "must be greater than or equal to 0"));

        MethodParameter methodParameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("shouldHandle400ForValidationErrors"), -1);

        MethodArgumentNotValidException ex = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ResponseEntity<Map<String, Object>> response = handler.handleValidation(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Validation failed", response.getBody().get("error"));
        Map<String, String> details = (Map<String, String>) response.getBody().get("details");
        assertEquals("must not be empty", details.get("combatants"));
        assertEquals("must be greater than or equal to 0", details.get("treasureValue"));
    }

    @Test
    @DisplayName("should return 404 NOT_FOUND for NoResourceFoundException")
    void shouldHandle404ForNoResourceFound() {
        var ex = new NoResourceFoundException(HttpMethod.GET, "api/maps/nowhere/extra");

        ResponseEntity<Map<String, String>> response = handler.handleNoResource(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody().get("error"));
    }
}
