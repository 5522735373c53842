package com.hercare.backend.modules.history.domain;

import java.util.UUID;

import com.hercare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 환자당 하나의 병력 레코드.
 */
@Entity
@Table(name = "medical_histories")
public class MedicalHistory extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "patient_id", nullable = false, unique = true, columnDefinition = "uuid")
    private UUID patientId;

    @Column(name = "allergies", columnDefinition = "text")
    private String allergies;

    @Column(name = "chronic_conditions", columnDefinition = "text")
    private String chronicConditions;

    @Column(name = "surgeries", columnDefinition = "text")
    private String surgeries;

    @Column(name = "medications", columnDefinition = "text")
    private String medications;

    @Column(name = "consulting_summary", columnDefinition = "text")
    private String consultingSummary;

    public UUID getId() {
        return id;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public void setPatientId(UUID patientId) {
        this.patientId = patientId;
    }

    public String getAllergies() {
        return allergies;
    }

    public void setAllergies(String allergies) {
        this.allergies = allergies;
    }

    public String getChronicConditions() {
        return chronicConditions;
    }

    public void setChronicConditions(String chronicConditions) {
        this.chronicConditions = chronicConditions;
    }

    public String getSurgeries() {
        return surgeries;
    }

    public void setSurgeries(String surgeries) {
        this.surgeries = surgeries;
    }

    public String getMedications() {
        return medications;
    }

    public void setMedications(String medications) {
        this.medications = medications;
    }

    public String getConsultingSummary() {
        return consultingSummary;
    }

    public void setConsultingSummary(String consultingSummary) {
        this.consultingSummary = consultingSummary;
    }

    /**
     * Fills the blank fields of this record from {@code other}. Existing values are kept.
     */
    public void fillBlanksFrom(MedicalHistory other) {
        allergies = preferExisting(allergies, other.allergies);
        chronicConditions = preferExisting(chronicConditions, other.chronicConditions);
        surgeries = preferExisting(surgeries, other.surgeries);
        medications = preferExisting(medications, other.medications);
        consultingSummary = preferExisting(consultingSummary, other.consultingSummary);
    }

    private static String preferExisting(String current, String fallback) {
        return current != null && !current.isBlank() ? current : fallback;
    }
}
