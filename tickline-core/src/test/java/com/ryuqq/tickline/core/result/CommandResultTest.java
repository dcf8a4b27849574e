package com.ryuqq.tickline.core.result;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandResult / CommandError 테스트.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
class CommandResultTest {

    @Test
    void success_IsSuccess() {
        CommandResult result = CommandResult.success();

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals(new Success(), result);
    }

    @Test
    void failure_CarriesCodeAndMessage() {
        // When
        CommandResult result = CommandResult.failure("INSUFFICIENT_RESOURCES", "Not enough gold");

        // Then
        assertTrue(result.isFailure());
        Failure failure = (Failure) result;
        assertEquals("INSUFFICIENT_RESOURCES", failure.code());
        assertEquals("Not enough gold", failure.error().message());
        assertNull(failure.error().details());
    }

    @Test
    void commandError_BlankCode_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CommandError.of(" ", "message")
        );
        assertTrue(exception.getMessage().contains("code cannot be null or blank"));
    }

    @Test
    void commandError_NullMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CommandError.of("CODE", null));
    }

    @Test
    void commandError_EmptyMessage_Allowed() {
        assertEquals("", CommandError.of("CODE", "").message());
    }

    @Test
    void commandError_DetailsAreCopied() {
        // Given
        Map<String, Object> details = new HashMap<>();
        details.put("type", "PURCHASE_GENERATOR");

        // When
        CommandError error = CommandError.of("CODE", "message", details);
        details.put("type", "CHANGED");

        // Then
        assertEquals("PURCHASE_GENERATOR", error.details().get("type"));
        assertThrows(UnsupportedOperationException.class, () -> error.details().put("x", 1));
    }

    @Test
    void failure_NullError_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Failure(null));
    }

    @Test
    void executionOutcome_NullResult_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CommandExecutionOutcome("req-1", 1L, null));
    }
}
