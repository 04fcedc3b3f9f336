package com.example.pricing_import.extraction;

import java.util.List;

import com.example.pricing_import.loader.RawRow;

/**
 * Recovers structured pricing fields from raw rows.
 * Implementations are untrusted: nothing they return is used without standardization and validation.
 */
public interface ExtractionClient {

    /**
     * @return one result per requested row; a result without a record means "no extraction"
     * @throws ExtractionClientException when the call itself fails
     */
    List<ExtractionResult> extract(List<RawRow> rows, ExtractionSchema schema);
}
