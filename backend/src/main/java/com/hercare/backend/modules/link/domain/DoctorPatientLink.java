package com.hercare.backend.modules.link.domain;

import java.util.UUID;

import com.hercare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * 의사-환자 연결.
 *
 * <p>{@code shareCode} is set only while the patient side is a shadow identity; claiming it moves
 * the link to the real patient and clears the code for good.</p>
 */
@Entity
@Table(
        name = "doctor_patient_links",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_link_doctor_patient", columnNames = {"doctor_id", "patient_id"}),
                @UniqueConstraint(name = "uq_link_share_code", columnNames = {"share_code"})
        }
)
public class DoctorPatientLink extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "doctor_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID doctorId;

    @Column(name = "patient_id", nullable = false, columnDefinition = "uuid")
    private UUID patientId;

    @Embedded
    private LinkPermissions permissions = LinkPermissions.unset();

    @Column(name = "share_code", length = 16)
    private String shareCode;

    protected DoctorPatientLink() {
    }

    public DoctorPatientLink(UUID doctorId, UUID patientId, String shareCode) {
        this.doctorId = doctorId;
        this.patientId = patientId;
        this.shareCode = shareCode;
    }

    public UUID getId() {
        return id;
    }

    public UUID getDoctorId() {
        return doctorId;
    }

    public UUID getPatientId() {
        return patientId;
    }

    public String getShareCode() {
        return shareCode;
    }

    public LinkPermissions getPermissions() {
        // Hibernate materialises an all-null embeddable as null
        return permissions != null ? permissions : LinkPermissions.unset();
    }

    public void replacePermissions(LinkPermissions permissions) {
        this.permissions = permissions != null ? permissions : LinkPermissions.unset();
    }

    public boolean connects(UUID doctor, UUID patient) {
        return doctorId.equals(doctor) && patientId.equals(patient);
    }

    /**
     * Points the link at the claiming patient and spends the share code.
     */
    public void reassignPatient(UUID realPatientId) {
        this.patientId = realPatientId;
        this.shareCode = null;
    }
}
