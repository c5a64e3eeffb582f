package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Group;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
@Profile("!local")
public interface JpaGroupRepository extends JpaRepository<Group, String> {
}
