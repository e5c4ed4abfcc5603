package com.adlanda.citedsearch.repository;

import java.util.Map;

/**
 * A record returned by a similarity query with its relevance score.
 */
public record IndexMatch(String id, double score, Map<String, Object> metadata) {}
