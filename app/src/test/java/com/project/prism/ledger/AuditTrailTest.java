package com.project.prism.ledger;

import com.project.prism.crypto.Fingerprint;
import com.project.prism.ledger.LedgerEvent.AccessApproved;
import com.project.prism.ledger.LedgerEvent.AccessRequested;
import com.project.prism.ledger.LedgerEvent.OwnerRegistered;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditTrailTest {

    private static final OwnerId PATIENT = OwnerId.of("patient-1");
    private static final OwnerId DOCTOR = OwnerId.of("doctor-1");
    private static final OwnerId OTHER = OwnerId.of("doctor-2");
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static Fingerprint fingerprint(int fill) {
        byte[] digest = new byte[Fingerprint.LENGTH_BYTES];
        Arrays.fill(digest, (byte) fill);
        return Fingerprint.of(digest);
    }

    private static InMemoryAccessLedger busyLedger(PointerRetention retention) {
        InMemoryAccessLedger ledger = new InMemoryAccessLedger(retention, Clock.fixed(NOW, ZoneOffset.UTC));
        Signer patient = Signer.of(PATIENT);
        ledger.registerOwner(patient);
        ledger.publishPointer(patient, "QmFirstContent01", fingerprint(1));
        ledger.requestAccess(Signer.of(DOCTOR), PATIENT);
        ledger.requestAccess(Signer.of(OTHER), PATIENT);
        ledger.approve(patient, DOCTOR);
        ledger.publishPointer(patient, "QmSecondContent2", fingerprint(2));
        ledger.revoke(patient, DOCTOR);
        ledger.requestAccess(Signer.of(DOCTOR), PATIENT);
        return ledger;
    }

    @Test
    void replayReproducesLiveState() throws Exception {
        for (PointerRetention retention : PointerRetention.values()) {
            InMemoryAccessLedger ledger = busyLedger(retention);

            LedgerState replayed = AuditTrail.of(ledger).replay(retention);

            assertTrue(replayed.isOwner(PATIENT));
            assertEquals(Set.of(PATIENT), replayed.owners());
            assertEquals(ledger.accessStatus(PATIENT, DOCTOR), replayed.status(PATIENT, DOCTOR));
            assertEquals(ledger.accessStatus(PATIENT, OTHER), replayed.status(PATIENT, OTHER));
            assertEquals(ledger.grantsFor(PATIENT), replayed.grantsFor(PATIENT));
            assertEquals(ledger.readPointerHistory(PATIENT, PATIENT), replayed.pointerHistory(PATIENT));
            assertEquals(ledger.events().size(), replayed.lastSequence());
        }
    }

    @Test
    void involvingFiltersByParty() throws Exception {
        AuditTrail trail = AuditTrail.of(busyLedger(PointerRetention.LATEST_ONLY));

        assertEquals(8, trail.involving(PATIENT).size());
        assertEquals(4, trail.involving(DOCTOR).size());
        assertEquals(1, trail.involving(OTHER).size());
    }

    @Test
    void replayRejectsIllegalTransitions() {
        AuditTrail trail = AuditTrail.of(List.of(
                new OwnerRegistered(1, PATIENT, NOW),
                new AccessApproved(2, PATIENT, DOCTOR, NOW)));

        LedgerRejectedException e = assertThrows(LedgerRejectedException.class,
                () -> trail.replay(PointerRetention.LATEST_ONLY));
        assertEquals(LedgerRejectedException.Reason.INVALID_TRANSITION, e.reason());
    }

    @Test
    void replayRejectsOutOfOrderSequences() {
        AuditTrail trail = AuditTrail.of(List.of(
                new OwnerRegistered(2, PATIENT, NOW),
                new OwnerRegistered(1, DOCTOR, NOW)));

        assertThrows(IllegalArgumentException.class, () -> trail.replay(PointerRetention.LATEST_ONLY));
    }

    @Test
    void describesEvents() {
        assertEquals("#3 2026-03-01T12:00:00Z AccessRequested doctor=doctor-1 patient=patient-1",
                AuditTrail.describe(new AccessRequested(3, DOCTOR, PATIENT, NOW)));
        assertEquals("#1 2026-03-01T12:00:00Z PatientRegistered patient=patient-1",
                AuditTrail.describe(new OwnerRegistered(1, PATIENT, NOW)));
    }
}
