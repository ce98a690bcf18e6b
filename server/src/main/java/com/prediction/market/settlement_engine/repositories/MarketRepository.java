package com.prediction.market.settlement_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Side;

/**
 * Market persistence. Decimal pool writes go through MongoTemplate in
 * MongoLedgerStore; status-only transitions live here.
 */
@Repository
public interface MarketRepository extends MongoRepository<Market, String> {

    /**
     * Atomically move an OPEN market to RESOLVED.
     *
     * @return 1 if this caller resolved the market, 0 if it was no longer OPEN
     */
    @Query("{ 'id': ?0, 'status': 'OPEN' }")
    @Update("{ $set: { 'status': 'RESOLVED', 'outcome': ?1, 'resolutionNote': ?2, 'resolvedAt': ?3, 'updatedAt': ?3 } }")
    long atomicResolve(String marketId, Side outcome, String note, long resolvedAt);
}
