package com.xksgroup.mediadedup.repo;

import com.xksgroup.mediadedup.model.CollectionDuplicates;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CollectionDuplicatesRepository extends MongoRepository<CollectionDuplicates, String> {
}
