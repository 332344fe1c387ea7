package villagecompute.dailybrief.data.models;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import villagecompute.dailybrief.jobs.JobType;

/**
 * Maps {@link JobType} to the wire name stored in {@code queue_jobs.job_type}, which the worker processes match on.
 */
@Converter
public class JobTypeConverter implements AttributeConverter<JobType, String> {

    @Override
    public String convertToDatabaseColumn(JobType jobType) {
        return jobType == null ? null : jobType.getWireName();
    }

    @Override
    public JobType convertToEntityAttribute(String wireName) {
        return wireName == null ? null : JobType.fromWireName(wireName);
    }
}
