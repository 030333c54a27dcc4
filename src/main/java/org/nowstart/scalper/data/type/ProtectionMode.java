package org.nowstart.scalper.data.type;

public enum ProtectionMode {
    // 익절 지정가 + 손절 스탑리밋 동시 배치
    BOTH,
    // 손절 스탑리밋만 배치하고 익절은 모니터에서 호가로 감시
    STOP_LOSS_ONLY
}
