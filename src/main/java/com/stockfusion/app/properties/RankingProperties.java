package com.stockfusion.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {
    /** Worker threads for per-stock scoring; 1 runs sequentially. */
    private int threads = 1;
    private String zone = "UTC";
}
