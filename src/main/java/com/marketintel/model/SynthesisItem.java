package com.marketintel.model;

import org.json.JSONObject;

import java.util.Map;

/**
 * A structured synthesis output. Implementations carry their required fields plus a catch-all
 * map of any additional keys the model produced.
 */
public interface SynthesisItem {
    String name();

    String description();

    Map<String, Object> extras();

    JSONObject toJson();
}
