package com.deepansh.pawsagent.records;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A veterinary consultation. Listings return only the summary fields (id, petId,
 * consultationType, date, chiefComplaint); a lookup by id fills in the rest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConsultationRecord {

    private String id;
    private String petId;
    private String consultationType;
    private Instant date;
    private String chiefComplaint;
    private String findings;
    private String diagnosis;
    private String nextSteps;
    private String additionalNotes;
    private Instant nextConsultation;
}
