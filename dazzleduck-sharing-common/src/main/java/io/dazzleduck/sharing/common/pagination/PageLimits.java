package io.dazzleduck.sharing.common.pagination;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.error.BadRequestException;

public record PageLimits(int defaultMaxResults, int maxResultsCeiling) {

    public static final PageLimits DEFAULT = new PageLimits(500, 1000);

    public static PageLimits load(Config config) {
        if (!config.hasPath(ConfigConstants.PAGINATION_KEY)) {
            return DEFAULT;
        }
        var pagination = config.getConfig(ConfigConstants.PAGINATION_KEY);
        return new PageLimits(pagination.getInt(ConfigConstants.DEFAULT_MAX_RESULTS_KEY),
                pagination.getInt(ConfigConstants.MAX_RESULTS_CEILING_KEY));
    }

    public int resolve(Integer maxResults) {
        if (maxResults == null) {
            return Math.min(defaultMaxResults, maxResultsCeiling);
        }
        if (maxResults < 1) {
            throw new BadRequestException("maxResults must be positive: " + maxResults);
        }
        return Math.min(maxResults, maxResultsCeiling);
    }
}
