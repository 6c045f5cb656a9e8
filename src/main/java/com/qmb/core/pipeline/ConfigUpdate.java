package com.qmb.core.pipeline;

import com.qmb.core.model.BuildConfig;

import java.util.List;

/**
 * @param applied option keys that changed the configuration
 * @param ignored option keys that were not recognised
 */
public record ConfigUpdate(BuildConfig config, List<String> applied, List<String> ignored) {}
