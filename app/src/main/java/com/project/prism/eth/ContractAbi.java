package com.project.prism.eth;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;

import java.util.Collections;
import java.util.List;

/**
 * Function and event definitions of the {@code PatientRegistry} and {@code DataAccess} contracts.
 */
final class ContractAbi {

    static final Event PATIENT_REGISTERED = new Event("PatientRegistered",
            List.of(new TypeReference<Address>(true) {}));

    static final Event DATA_UPLOADED = new Event("DataUploaded",
            List.of(new TypeReference<Address>(true) {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Utf8String>() {}));

    static final Event ACCESS_REQUESTED = new Event("AccessRequested",
            List.of(new TypeReference<Address>(true) {}, new TypeReference<Address>(true) {}));

    static final Event ACCESS_APPROVED = new Event("AccessApproved",
            List.of(new TypeReference<Address>(true) {}, new TypeReference<Address>(true) {}));

    static final Event ACCESS_REVOKED = new Event("AccessRevoked",
            List.of(new TypeReference<Address>(true) {}, new TypeReference<Address>(true) {}));

    static final String PATIENT_REGISTERED_TOPIC = EventEncoder.encode(PATIENT_REGISTERED);
    static final String DATA_UPLOADED_TOPIC = EventEncoder.encode(DATA_UPLOADED);
    static final String ACCESS_REQUESTED_TOPIC = EventEncoder.encode(ACCESS_REQUESTED);
    static final String ACCESS_APPROVED_TOPIC = EventEncoder.encode(ACCESS_APPROVED);
    static final String ACCESS_REVOKED_TOPIC = EventEncoder.encode(ACCESS_REVOKED);

    private ContractAbi() {
    }

    // PatientRegistry

    static Function register() {
        return new Function("register", Collections.emptyList(), Collections.emptyList());
    }

    static Function isPatient(String address) {
        return new Function("isPatient", List.of(new Address(address)), List.of(new TypeReference<Bool>() {}));
    }

    // DataAccess

    static Function uploadData(String contentId, String blake3Hex) {
        return new Function("uploadData",
                List.of(new Utf8String(contentId), new Utf8String(blake3Hex)),
                Collections.emptyList());
    }

    static Function getGenomicData(String patient) {
        return new Function("getGenomicData",
                List.of(new Address(patient)),
                List.of(new TypeReference<Utf8String>() {}, new TypeReference<Utf8String>() {}));
    }

    static Function requestAccess(String patient) {
        return new Function("requestAccess", List.of(new Address(patient)), Collections.emptyList());
    }

    static Function approveAccess(String doctor) {
        return new Function("approveAccess", List.of(new Address(doctor)), Collections.emptyList());
    }

    static Function revokeAccess(String doctor) {
        return new Function("revokeAccess", List.of(new Address(doctor)), Collections.emptyList());
    }

    static Function checkAccess(String patient, String doctor) {
        return new Function("checkAccess",
                List.of(new Address(patient), new Address(doctor)),
                List.of(new TypeReference<Bool>() {}));
    }
}
