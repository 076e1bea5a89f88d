package com.deepansh.pawsagent.records;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Port to the external pet records service. Phones are passed already normalized
 * (digits and '+').
 *
 * Implementations throw {@link com.deepansh.pawsagent.exception.TransientExternalException}
 * for failures worth retrying and
 * {@link com.deepansh.pawsagent.exception.RecordRejectedException} for refusals.
 */
public interface PetRecordsGateway {

    Optional<OwnerRecord> findOwnerByPhone(String phone);

    /** Creates the owner, or updates the name of an existing one. */
    OwnerRecord registerOwner(String name, String phone);

    List<PetRecord> listPetsByOwnerPhone(String phone);

    PetRecord createPet(String name, Species species, LocalDate dateOfBirth, String ownerPhone);

    /** Summaries of a pet's consultations; empty when the pet has none or is unknown. */
    List<ConsultationRecord> listConsultations(String petId);

    Optional<ConsultationRecord> getConsultation(String consultationId);
}
