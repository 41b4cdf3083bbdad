package com.example.sessionmeter.repo;

import com.example.sessionmeter.model.DailyUsage;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DailyUsageRepo extends MongoRepository<DailyUsage, String> {}
