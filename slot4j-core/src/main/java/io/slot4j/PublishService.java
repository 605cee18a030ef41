package io.slot4j;

import io.slot4j.core.PublishResult;

import java.util.Map;

public interface PublishService {
    PublishResult publish(String accountId, Map<String, Object> artifact) throws Exception;
}
