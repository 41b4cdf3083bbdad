package com.example.sessionmeter.repo;

import com.example.sessionmeter.model.SessionLogEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SessionLogRepo extends MongoRepository<SessionLogEntry, String> {
    List<SessionLogEntry> findAllByOrderByLogTimeAsc();
}
