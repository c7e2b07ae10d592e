package com.sapa.speakers.model;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class SettableTest {

    @Test
    public void distinguishesAbsentFromCleared() {
        Settable<String> absent = Settable.absent();
        Settable<String> cleared = Settable.cleared();
        Settable<String> set = Settable.of("Stanford");

        assertTrue(absent.isAbsent());
        assertFalse(absent.isCleared());
        assertTrue(cleared.isCleared());
        assertFalse(cleared.isSet());
        assertTrue(set.isSet());
        assertEquals("Stanford", set.get());
        assertNotEquals(absent, cleared);
        assertEquals(Settable.of("Stanford"), set);
    }

    @Test
    public void ofNullableTreatsNullAsAbsent() {
        assertTrue(Settable.ofNullable(null).isAbsent());
        assertTrue(Settable.ofNullable("x").isSet());
    }

    @Test
    public void getWithoutValueFails() {
        assertThrows(NoSuchElementException.class, () -> Settable.cleared().get());
        assertThrows(NoSuchElementException.class, () -> Settable.absent().get());
    }
}
