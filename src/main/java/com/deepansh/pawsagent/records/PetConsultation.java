package com.deepansh.pawsagent.records;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;

/** A consultation labelled with the pet it belongs to, as handed back to the model. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PetConsultation {

    /** Most recent first; undated consultations last. */
    public static final Comparator<PetConsultation> NEWEST_FIRST = Comparator.comparing(
            (PetConsultation c) -> c.getConsultation().getDate(),
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    @JsonUnwrapped
    private ConsultationRecord consultation;

    private String petName;
    private Species petSpecies;

    public static PetConsultation of(ConsultationRecord consultation, PetRecord pet) {
        return new PetConsultation(consultation, pet.getName(), pet.getSpecies());
    }
}
