package com.deepansh.pawsagent.records;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PetRecord {

    private String id;
    private String name;
    private Species species;
    private LocalDate dateOfBirth;
    private String ownerPhone;
}
