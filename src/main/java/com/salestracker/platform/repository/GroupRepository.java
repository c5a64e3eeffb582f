package com.salestracker.platform.repository;

import com.salestracker.platform.model.Group;

import java.util.List;
import java.util.Optional;

public interface GroupRepository {
    Group save(Group group);
    Optional<Group> findById(String groupId);
    List<Group> findAll();
}
