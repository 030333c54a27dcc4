package org.nowstart.scalper.repository;

import org.nowstart.scalper.data.dto.ValrMarketSummaryResponse;
import org.nowstart.scalper.data.dto.ValrServerTimeResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(name = "valrPublicClient", url = "${scalper.valr.base-url}")
public interface ValrPublicFeignClient {

    @GetMapping("/v1/public/time")
    ValrServerTimeResponse getServerTime();

    @GetMapping("/v1/public/{pair}/marketsummary")
    ValrMarketSummaryResponse getMarketSummary(@PathVariable("pair") String pair);
}
