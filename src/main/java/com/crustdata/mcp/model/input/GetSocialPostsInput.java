package com.crustdata.mcp.model.input;

import com.crustdata.mcp.api.Param;

/**
 * Input for {@code crustdata_get_social_posts}.
 */
public record GetSocialPostsInput(
    @Param("LinkedIn profile URL of the person")
    String personLinkedinUrl,

    @Param(value = "Page number for pagination (20 posts per page)", defaultValue = "1", minimum = 1)
    int page
) {}
