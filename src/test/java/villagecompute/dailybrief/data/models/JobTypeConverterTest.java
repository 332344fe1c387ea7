package villagecompute.dailybrief.data.models;

import org.junit.jupiter.api.Test;
import villagecompute.dailybrief.jobs.JobType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link JobTypeConverter}.
 */
class JobTypeConverterTest {

    private final JobTypeConverter converter = new JobTypeConverter();

    @Test
    void testToColumn_writesWireName() {
        assertEquals("generate_daily_brief", converter.convertToDatabaseColumn(JobType.GENERATE_DAILY_BRIEF),
                "Workers match on the lowercase wire name, not the enum constant");
    }

    @Test
    void testToAttribute_readsWireName() {
        assertEquals(JobType.GENERATE_DAILY_BRIEF, converter.convertToEntityAttribute("generate_daily_brief"));
    }

    @Test
    void testNull_passesThrough() {
        assertNull(converter.convertToDatabaseColumn(null));
        assertNull(converter.convertToEntityAttribute(null));
    }

    @Test
    void testToAttribute_enumConstantName_rejected() {
        assertThrows(IllegalArgumentException.class, () -> converter.convertToEntityAttribute("GENERATE_DAILY_BRIEF"));
    }
}
