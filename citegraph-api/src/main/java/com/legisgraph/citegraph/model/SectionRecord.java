package com.legisgraph.citegraph.model;

import jakarta.validation.constraints.NotBlank;

/**
 * One U.S. Code section as read from the USC XML release. {@code sectionId} is the section's
 * canonical citation, e.g. {@code "42 USC 1395"}.
 */
public record SectionRecord(@NotBlank String sectionId,
                            int title,
                            String section,
                            String subsection,
                            String sectionName,
                            String titleName,
                            String chapter,
                            String sourceCredit,
                            String text) {
}
