package com.ryuqq.tickline.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command Record 테스트.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
class CommandTest {

    @Test
    void of_ValidValues_CreatesCommand() {
        // Given
        Map<String, Object> payload = Map.of("generatorId", "gen-1");

        // When
        Command command = Command.of(RuntimeCommandTypes.PURCHASE_GENERATOR, CommandPriority.PLAYER, payload, 1000L, 5L);

        // Then
        assertEquals(RuntimeCommandTypes.PURCHASE_GENERATOR, command.type());
        assertEquals(CommandPriority.PLAYER, command.priority());
        assertSame(payload, command.payload());
        assertEquals(1000L, command.timestamp());
        assertEquals(5L, command.step());
        assertNull(command.requestId());
    }

    @Test
    void constructor_NullPayload_CreatesCommand() {
        Command command = Command.of("TEST", CommandPriority.SYSTEM, null, 0L, 0L);

        assertNull(command.payload());
    }

    @Test
    void constructor_BlankType_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Command.of("  ", CommandPriority.SYSTEM, null, 0L, 0L)
        );
        assertTrue(exception.getMessage().contains("type cannot be null or blank"));
    }

    @Test
    void constructor_NullPriority_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Command.of("TEST", null, null, 0L, 0L)
        );
        assertTrue(exception.getMessage().contains("Invalid command priority"));
    }

    @Test
    void withPayload_ReplacesOnlyPayload() {
        // Given
        Command original = new Command("TEST", CommandPriority.PLAYER, "a", 10L, 3L, "req-1");

        // When
        Command copy = original.withPayload("b");

        // Then
        assertEquals("b", copy.payload());
        assertEquals("a", original.payload());
        assertEquals(original.requestId(), copy.requestId());
        assertEquals(original.step(), copy.step());
    }

    @Test
    void withStep_ReplacesOnlyStep() {
        Command original = new Command("TEST", CommandPriority.PLAYER, "a", 10L, 3L, "req-1");

        Command copy = original.withStep(9L);

        assertEquals(9L, copy.step());
        assertEquals("a", copy.payload());
    }
}
