package com.mergington.highschool.repository;

import com.mergington.highschool.model.Activity;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ActivityRepository extends MongoRepository<Activity, String>, ActivityRepositoryCustom {
}
