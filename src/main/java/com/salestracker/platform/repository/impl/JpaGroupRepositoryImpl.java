package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Group;
import com.salestracker.platform.repository.GroupRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Profile("!local")
public class JpaGroupRepositoryImpl implements GroupRepository {

    private final JpaGroupRepository jpaRepository;

    @Autowired
    public JpaGroupRepositoryImpl(JpaGroupRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Group save(Group group) {
        return jpaRepository.save(group);
    }

    @Override
    public Optional<Group> findById(String groupId) {
        return jpaRepository.findById(groupId);
    }

    @Override
    public List<Group> findAll() {
        return jpaRepository.findAll();
    }
}
