package com.contactcare.backend.modules.child.infrastructure.persistence;

import java.util.UUID;

import com.contactcare.backend.modules.child.domain.Child;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ChildRepository extends JpaRepository<Child, UUID> {
}
