package com.deepansh.kitchen.inventory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PantryRepository extends MongoRepository<PantryItemDocument, String> {

    Optional<PantryItemDocument> findByName(String name);

    List<PantryItemDocument> findAllByOrderByNameAsc();
}
