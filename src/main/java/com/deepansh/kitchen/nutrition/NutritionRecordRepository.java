package com.deepansh.kitchen.nutrition;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NutritionRecordRepository extends MongoRepository<NutritionRecord, String> {

    List<NutritionRecord> findBySessionIdOrderByRecordedAtDesc(String sessionId);
}
