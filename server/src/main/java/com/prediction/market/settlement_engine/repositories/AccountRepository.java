package com.prediction.market.settlement_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.Account;

@Repository
public interface AccountRepository extends MongoRepository<Account, String> {
}
