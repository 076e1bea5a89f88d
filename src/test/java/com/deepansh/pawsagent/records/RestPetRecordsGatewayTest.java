package com.deepansh.pawsagent.records;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.RecordRejectedException;
import com.deepansh.pawsagent.exception.TransientExternalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestPetRecordsGatewayTest {

    private static final String BASE = "http://records.test/api";

    private MockRestServiceServer server;
    private RestPetRecordsGateway gateway;

    @BeforeEach
    void setUp() {
        ToolProperties props = new ToolProperties();
        props.getRecords().setBaseUrl(BASE);
        props.getRecords().setApiToken("secret");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new RestPetRecordsGateway(builder, props);
    }

    // the phone is a URI variable, so its '+' is percent-encoded
    @Test
    void findOwnerByPhone_found_mapsRecord() {
        server.expect(requestTo(BASE + "/users/by-phone/%2B5491100000000"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer secret"))
                .andRespond(withSuccess("{\"id\":\"u1\",\"name\":\"Ana\",\"phone\":\"+5491100000000\",\"extra\":true}",
                        MediaType.APPLICATION_JSON));

        assertThat(gateway.findOwnerByPhone("+5491100000000"))
                .contains(new OwnerRecord("u1", "Ana", "+5491100000000"));
        server.verify();
    }

    @Test
    void findOwnerByPhone_notFound_isEmpty() {
        server.expect(requestTo(BASE + "/users/by-phone/%2B5491100000000"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(gateway.findOwnerByPhone("+5491100000000")).isEmpty();
    }

    @Test
    void listPetsByOwnerPhone_notFound_isEmptyList() {
        server.expect(requestTo(BASE + "/users/by-phone/%2B5491100000000/pets"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(gateway.listPetsByOwnerPhone("+5491100000000")).isEmpty();
    }

    @Test
    void createPet_postsNormalizedBody() {
        server.expect(requestTo(BASE + "/pets"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.species").value("DOG"))
                .andExpect(jsonPath("$.dateOfBirth").value("2020-05-01"))
                .andRespond(withSuccess("{\"id\":\"p1\",\"name\":\"Rocky\",\"species\":\"DOG\","
                        + "\"dateOfBirth\":\"2020-05-01\",\"ownerPhone\":\"+5491100000000\"}", MediaType.APPLICATION_JSON));

        PetRecord pet = gateway.createPet("Rocky", Species.DOG, LocalDate.of(2020, 5, 1), "+5491100000000");

        assertThat(pet.getId()).isEqualTo("p1");
        assertThat(pet.getDateOfBirth()).isEqualTo(LocalDate.of(2020, 5, 1));
        server.verify();
    }

    @Test
    void registerOwner_clientError_isRejection() {
        server.expect(requestTo(BASE + "/users"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.TEXT_PLAIN)
                        .body("phone already registered"));

        assertThatThrownBy(() -> gateway.registerOwner("Ana", "+5491100000000"))
                .isInstanceOf(RecordRejectedException.class)
                .hasMessage("phone already registered");
    }

    @Test
    void listPetsByOwnerPhone_serverError_isTransient() {
        server.expect(requestTo(BASE + "/users/by-phone/%2B5491100000000/pets"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> gateway.listPetsByOwnerPhone("+5491100000000"))
                .isInstanceOf(TransientExternalException.class);
    }

    @Test
    void listPetsByOwnerPhone_returnsList() {
        server.expect(requestTo(BASE + "/users/by-phone/%2B5491100000000/pets"))
                .andRespond(withSuccess("[{\"id\":\"p1\",\"name\":\"Luna\",\"species\":\"CAT\"}]",
                        MediaType.APPLICATION_JSON));

        List<PetRecord> pets = gateway.listPetsByOwnerPhone("+5491100000000");

        assertThat(pets).extracting(PetRecord::getSpecies).containsExactly(Species.CAT);
    }

    @Test
    void listConsultations_returnsSummaries() {
        server.expect(requestTo(BASE + "/pets/p1/consultations"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"id\":\"c1\",\"petId\":\"p1\",\"consultationType\":\"CONTROL\","
                        + "\"date\":\"2024-05-02T15:00:00.000Z\",\"chiefComplaint\":\"Vómitos\"}]",
                        MediaType.APPLICATION_JSON));

        List<ConsultationRecord> consultations = gateway.listConsultations("p1");

        assertThat(consultations).hasSize(1);
        assertThat(consultations.get(0).getDate()).isEqualTo(Instant.parse("2024-05-02T15:00:00Z"));
        assertThat(consultations.get(0).getChiefComplaint()).isEqualTo("Vómitos");
    }

    @Test
    void listConsultations_unknownPet_isEmptyList() {
        server.expect(requestTo(BASE + "/pets/p404/consultations"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(gateway.listConsultations("p404")).isEmpty();
    }

    @Test
    void getConsultation_found_mapsDetail() {
        server.expect(requestTo(BASE + "/consultations/c1"))
                .andRespond(withSuccess("{\"id\":\"c1\",\"petId\":\"p1\",\"diagnosis\":\"Gastritis\","
                        + "\"nextConsultation\":null,\"treatment\":[]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.getConsultation("c1"))
                .hasValueSatisfying(c -> assertThat(c.getDiagnosis()).isEqualTo("Gastritis"));
    }

    @Test
    void getConsultation_notFound_isEmpty() {
        server.expect(requestTo(BASE + "/consultations/c404"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(gateway.getConsultation("c404")).isEmpty();
    }
}
