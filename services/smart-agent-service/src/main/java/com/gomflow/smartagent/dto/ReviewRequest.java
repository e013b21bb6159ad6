package com.gomflow.smartagent.dto;

import com.gomflow.smartagent.domain.ManualCorrections;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {

    @NotNull(message = "Extraction ID is required")
    private UUID extractionId;

    @NotNull(message = "Review action is required")
    private ReviewAction action;

    @Size(max = 64)
    private String approvedCandidateId;

    @Valid
    private Corrections corrections;

    @Size(max = 2000)
    private String notes;

    @NotBlank(message = "Reviewer ID is required")
    @Size(max = 100)
    private String reviewerId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Corrections {

        @DecimalMin(value = "0.01", message = "Corrected amount must be positive")
        private BigDecimal amount;

        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter code")
        private String currency;

        @Size(max = 30)
        private String method;

        @Size(max = 64)
        private String reference;

        public ManualCorrections toManualCorrections() {
            return new ManualCorrections(amount,
                    currency != null ? currency.toUpperCase(Locale.ROOT) : null,
                    method,
                    reference);
        }
    }
}
