package com.deepansh.pawsagent.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationTraceRepository extends MongoRepository<ConversationTrace, String> {
}
