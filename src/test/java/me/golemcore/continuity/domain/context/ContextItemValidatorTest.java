package me.golemcore.continuity.domain.context;

import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextItemValidatorTest {

    private final ContextItemValidator validator = new ContextItemValidator(new ContinuityProperties());

    private static ContextItem.ContextItemBuilder valid() {
        return ContextItem.builder().type("vision").id("v").title("Vision").content("Stay focused");
    }

    @Test
    void acceptsCompleteItemWithOrWithoutPriority() {
        assertTrue(validator.isValid(valid().build()));
        assertTrue(validator.isValid(valid().priority(0.0).build()));
        assertTrue(validator.isValid(valid().priority(1.0).build()));
    }

    @Test
    void rejectsMissingOrBlankRequiredFields() {
        assertFalse(validator.isValid(valid().content(null).build()));
        assertFalse(validator.isValid(valid().content("  ").build()));
        assertFalse(validator.isValid(valid().title("").build()));
        assertFalse(validator.isValid(valid().id(null).build()));
        assertFalse(validator.isValid(valid().type(null).build()));
        assertFalse(validator.isValid(null));
    }

    @Test
    void rejectsPriorityOutsideUnitInterval() {
        assertFalse(validator.isValid(valid().priority(1.2).build()));
        assertFalse(validator.isValid(valid().priority(-0.1).build()));
        assertFalse(validator.isValid(valid().priority(Double.NaN).build()));
    }

    @Test
    void filterValidDropsInvalidItemsKeepingOrder() {
        ContextItem first = valid().id("1").build();
        ContextItem second = valid().id("2").build();

        List<ContextItem> result = validator.filterValid(Arrays.asList(first, valid().content(null).build(), null,
                second));

        assertEquals(List.of(first, second), result);
    }

    @Test
    void disabledValidationOnlyRejectsNull() {
        ContinuityProperties properties = new ContinuityProperties();
        properties.getContext().setValidationEnabled(false);
        ContextItemValidator lenient = new ContextItemValidator(properties);

        assertTrue(lenient.isValid(valid().content(null).build()));
        assertFalse(lenient.isValid(null));
    }
}
