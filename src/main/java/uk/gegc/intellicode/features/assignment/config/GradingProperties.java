package uk.gegc.intellicode.features.assignment.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import uk.gegc.intellicode.features.assignment.domain.grading.EnumerationMatchMode;

@Data
@Validated
@ConfigurationProperties(prefix = "app.grading")
public class GradingProperties {

    @NotNull
    private EnumerationMatchMode enumerationMatchMode = EnumerationMatchMode.COUNT_EVERY_MATCH;
}
