package org.nowstart.rightside.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI rightsideOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("rightside backtest API")
                        .description("""
                                Replays the capitulation / right-side-of-V long strategy over stored 2-minute bars.
                                GET /api/backtest/symbols lists symbols in the bar store,
                                GET /api/backtest/{symbol} returns trades and metrics for one symbol,
                                GET /api/backtest/{symbol}/chart returns candles, VWAP/EMA lines and trade markers,
                                POST /api/backtest/suite runs many symbols and combines their metrics.
                                Store timestamps are exchange wall-clock times (America/Chicago by default).""")
                        .version(buildProperties.getVersion()));
    }
}
