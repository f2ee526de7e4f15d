package com.contactcare.backend.modules.family.domain;

public enum RelationshipType {
    PARENT,
    SIBLING,
    GRANDPARENT,
    OTHER_RELATIVE,
    OTHER
}
