package com.mergington.highschool.repository;

import com.mergington.highschool.model.Activity;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class ActivityRepositoryImpl implements ActivityRepositoryCustom {

    private static final String DAYS_FIELD = "schedule_details.days";

    private final MongoOperations mongo;

    public ActivityRepositoryImpl(MongoOperations mongo) {
        this.mongo = mongo;
    }

    @Override
    public long addParticipant(String activityName, String email) {
        // The $ne guard keeps a concurrent duplicate signup from being pushed twice
        Query q = new Query()
                .addCriteria(Criteria.where("_id").is(activityName)
                        .and("participants").ne(email));
        return mongo.updateFirst(q, new Update().push("participants", email), Activity.class)
                .getModifiedCount();
    }

    @Override
    public long removeParticipant(String activityName, String email) {
        Query q = new Query().addCriteria(Criteria.where("_id").is(activityName));
        return mongo.updateFirst(q, new Update().pull("participants", email), Activity.class)
                .getModifiedCount();
    }

    @Override
    public List<String> findDistinctScheduledDays() {
        Aggregation pipeline = Aggregation.newAggregation(
                Aggregation.unwind(DAYS_FIELD),
                Aggregation.group(DAYS_FIELD),
                Aggregation.sort(Sort.Direction.ASC, "_id"));

        AggregationResults<Document> results = mongo.aggregate(pipeline, "activities", Document.class);
        return results.getMappedResults().stream()
                .map(doc -> doc.get("_id"))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .collect(Collectors.toList());
    }
}
