package com.docgen.infrastructure.ai.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "docgen.reliability")
public class OutputReliabilityProperties {

    /**
     * Literal anchor lines protected from AI rewrites, in priority order.
     */
    @NotEmpty
    private List<@NotBlank String> templateLabels = new ArrayList<>();

    /**
     * Regular expressions for token formats that count as leaked: current format first,
     * then formats used by earlier releases.
     */
    @NotEmpty
    private List<@NotBlank String> leakedTokenPatterns = new ArrayList<>();
}
