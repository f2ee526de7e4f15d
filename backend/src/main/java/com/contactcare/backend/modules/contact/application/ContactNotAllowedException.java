package com.contactcare.backend.modules.contact.application;

import java.util.UUID;

import com.contactcare.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Raised when contact is requested for a family member whose status, restriction level
 * or background check currently rules contact out. Needs a status change by staff.
 */
public class ContactNotAllowedException extends ProblemException {

    public static final String CODE = "CONTACT_NOT_ALLOWED";

    private final UUID familyMemberId;
    private final String familyMemberName;

    public ContactNotAllowedException(UUID familyMemberId, String familyMemberName) {
        super(HttpStatus.CONFLICT, CODE, "Contact not allowed for family member " + familyMemberName);
        this.familyMemberId = familyMemberId;
        this.familyMemberName = familyMemberName;
    }

    public UUID getFamilyMemberId() {
        return familyMemberId;
    }

    public String getFamilyMemberName() {
        return familyMemberName;
    }
}
