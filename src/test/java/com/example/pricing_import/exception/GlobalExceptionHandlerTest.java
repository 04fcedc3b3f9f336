package com.example.pricing_import.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import com.example.pricing_import.loader.EmptyFileException;
import com.example.pricing_import.loader.UnreadableFileException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void fileLevelFailures_areUnprocessableEntity() {
        ResponseEntity<Object> unreadable = handler.handleUnreadable(new UnreadableFileException("corrupt"));
        ResponseEntity<Object> empty = handler.handleEmpty(new EmptyFileException("no rows"));

        assertEquals(422, unreadable.getStatusCode().value());
        assertEquals("UNREADABLE_FILE", ((Map<?, ?>) unreadable.getBody()).get("error"));
        assertEquals(422, empty.getStatusCode().value());
        assertEquals("no rows", ((Map<?, ?>) empty.getBody()).get("message"));
    }

    @Test
    void badInput_isBadRequest_andUnexpected_isServerErrorWithReference() {
        assertEquals(400, handler.handleIllegalArgument(new IllegalArgumentException("x")).getStatusCode().value());

        ResponseEntity<Object> res = handler.handleGeneralError(new RuntimeException("boom"));
        assertEquals(500, res.getStatusCode().value());
        assertEquals(true, ((String) ((Map<?, ?>) res.getBody()).get("message")).contains("Ref: "));
    }
}
