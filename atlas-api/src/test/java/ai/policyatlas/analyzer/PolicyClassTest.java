package ai.policyatlas.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class PolicyClassTest {

    @Test
    public void parsesAttributeIgnoringCase() {
        assertEquals(Optional.of(PolicyClass.MACHINE), PolicyClass.fromAttribute("Machine"));
        assertEquals(Optional.of(PolicyClass.USER), PolicyClass.fromAttribute("user"));
        assertEquals(Optional.of(PolicyClass.BOTH), PolicyClass.fromAttribute(" BOTH "));
    }

    @Test
    public void blankOrUnknownIsEmpty() {
        assertTrue(PolicyClass.fromAttribute(null).isEmpty());
        assertTrue(PolicyClass.fromAttribute("  ").isEmpty());
        assertTrue(PolicyClass.fromAttribute("Computer").isEmpty());
    }

    @Test
    public void labelIsTheWrittenForm() {
        assertEquals("Machine", PolicyClass.MACHINE.label());
        assertEquals("Both", PolicyClass.BOTH.toString());
    }
}
