package com.phillippitts.navguide.presentation.exception;

import com.phillippitts.navguide.exception.InvalidFrameException;
import com.phillippitts.navguide.exception.SpeechOutputException;
import com.phillippitts.navguide.service.speech.SpeechTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesInvalidFrameReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidFrame(
                new InvalidFrameException(0, 480, "image dimensions must be positive"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidFrameException")
                .contains("Invalid frame")
                .contains("image dimensions must be positive");
    }

    @Test
    void verifiesValidationErrorListsFields() {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(new Object(), "frameRequest");
        binding.addError(new FieldError("frameRequest", "imageWidth", "must be greater than 0"));
        binding.addError(new FieldError("frameRequest", "detections", "must not be null"));

        ResponseEntity<?> response = handler.handleValidation(
                new MethodArgumentNotValidException(mock(MethodParameter.class), binding));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("ValidationError")
                .contains("imageWidth must be greater than 0; detections must not be null");
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Scene description must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Scene description must not be blank");
    }

    @Test
    void verifiesSpeechOutputReturns503() {
        ResponseEntity<?> response = handler.handleSpeechOutput(
                new SpeechOutputException("Scene description was not spoken", SpeechTier.NAVIGATION));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("SpeechOutputException")
                .contains("Speech output temporarily unavailable");
    }

    @Test
    void verifiesUnexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret internal state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret internal state");
    }

    @Test
    void verifiesErrorBodyCarriesTimestamp() {
        ResponseEntity<?> response = handler.handleInvalidFrame(new InvalidFrameException("detection list is missing"));

        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
