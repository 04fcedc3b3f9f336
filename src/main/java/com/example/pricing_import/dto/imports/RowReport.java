package com.example.pricing_import.dto.imports;

import java.math.BigDecimal;

import com.example.pricing_import.classify.Category;
import com.example.pricing_import.classify.ClassificationSource;
import com.example.pricing_import.imports.RowReason;
import com.example.pricing_import.imports.RowStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RowReport {

    /** Non-fatal: the unit was kept as written because it matched no known unit. */
    public static final String UNIT_UNRESOLVABLE = "unit_unresolvable";

    int position;
    RowStatus status;
    RowReason reason;
    String detail;
    Integer primaryPosition;
    Long pricingRecordId;
    String productName;
    BigDecimal price;
    String currency;
    String unit;
    Category category;
    ClassificationSource classificationSource;
    String warning;
}
