package org.nowstart.scalper.data.type;

public enum EntryPricing {
    // 최우선 매도호가에 지정가 매수 (즉시 체결 지향)
    ASK_CROSS,
    // 최우선 매수호가에 post-only 지정가 매수 (메이커 수수료)
    BID_JOIN,
    // 호가 금액 기준 시장가 매수
    MARKET
}
