package com.salestracker.platform.repository.impl;

import com.salestracker.platform.model.Group;
import com.salestracker.platform.repository.GroupRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("local")
public class JsonGroupRepository implements GroupRepository {

    private final JsonDocumentCollection<Group> groups;

    public JsonGroupRepository(@Value("${salestracker.storage.directory:./data}") String dataDirectory) {
        this.groups = new JsonDocumentCollection<>(dataDirectory, "groups", Group.class, Group::getGroupId);
    }

    @Override
    public Group save(Group group) {
        return groups.save(group);
    }

    @Override
    public Optional<Group> findById(String groupId) {
        return groups.findById(groupId);
    }

    @Override
    public List<Group> findAll() {
        // Registration order keeps fan-out order stable across restarts
        return groups.findAll().stream()
            .sorted(Comparator.comparing(Group::getCreatedAt).thenComparing(Group::getGroupId))
            .toList();
    }
}
