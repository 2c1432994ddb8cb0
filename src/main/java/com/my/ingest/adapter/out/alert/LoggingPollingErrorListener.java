package com.my.ingest.adapter.out.alert;

import com.my.ingest.domain.model.PollingError;
import com.my.ingest.domain.port.out.PollingErrorListener;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

/**
 * 왜: 세션이 보고한 오류를 운영 로그로 남겨 알림 파이프라인이 계정별 장애를 감지할 수 있게 하기 위함.
 */
@ApplicationScoped
public class LoggingPollingErrorListener implements PollingErrorListener {

    private static final Logger log = Logger.getLogger(LoggingPollingErrorListener.class);

    @Override
    public void onError(PollingError error) {
        MDC.put("accountId", error.accountId());
        try {
            if (error.terminal()) {
                log.errorf(error.cause(), "계정 폴링이 오류 상태입니다: kind=%s cause=%s", error.kind(), error.message());
            } else {
                log.warnf("이벤트 처리 실패: eventId=%s cause=%s", error.eventId(), error.message());
            }
        } finally {
            MDC.remove("accountId");
        }
    }
}
