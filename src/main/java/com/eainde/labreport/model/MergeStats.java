package com.eainde.labreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Statistics from the merge pass that de-duplicates candidates by canonical name.
 *
 * @param totalCandidatesBeforeMerge candidates across all passes
 * @param totalCandidatesAfterMerge  unique canonical names kept
 * @param duplicatesRemoved          candidates dropped as duplicates
 * @param replacedByHigherConfidence duplicates that displaced an earlier, weaker record
 */
public record MergeStats(
        @JsonProperty("totalCandidatesBeforeMerge") int totalCandidatesBeforeMerge,
        @JsonProperty("totalCandidatesAfterMerge")  int totalCandidatesAfterMerge,
        @JsonProperty("duplicatesRemoved")          int duplicatesRemoved,
        @JsonProperty("replacedByHigherConfidence") int replacedByHigherConfidence
) implements Serializable {}
