package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identifying metadata of an EBD table. Passed through to the graph unchanged.
 *
 * @param ebdCode EBD identifier, e.g. "E_0053"
 * @param chapter chapter of the source document
 * @param section section of the source document
 * @param ebdName EBD name, e.g. "E_0003_Bestellung der Aggregationsebene RZ prüfen"
 * @param role checking market role ("Prüfende Rolle"), e.g. "NB"
 * @param remark optional remark
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EbdTableMetadata(
    @JsonProperty("ebdCode") String ebdCode,
    @JsonProperty("chapter") String chapter,
    @JsonProperty("section") String section,
    @JsonProperty("ebdName") String ebdName,
    @JsonProperty("role") String role,
    @JsonProperty("remark") String remark
) {
    /**
     * Compact constructor with validation.
     */
    public EbdTableMetadata {
        Objects.requireNonNull(ebdCode, "ebdCode must not be null");
    }

    /**
     * Creates metadata carrying only the EBD code and role.
     *
     * @param ebdCode EBD identifier
     * @param role checking role
     * @return metadata
     */
    public static EbdTableMetadata of(String ebdCode, String role) {
        return new EbdTableMetadata(ebdCode, null, null, null, role, null);
    }
}
