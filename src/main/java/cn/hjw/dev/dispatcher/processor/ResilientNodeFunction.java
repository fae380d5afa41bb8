package cn.hjw.dev.dispatcher.processor;

import cn.hjw.dev.dispatcher.config.NodeGovernance;
import cn.hjw.dev.dispatcher.hook.FallbackStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 治理装饰器：失败重试，重试耗尽后走降级
 * 由 GraphCompiler 在编译期按 NodeGovernance 包装
 */
@Slf4j
@RequiredArgsConstructor
public class ResilientNodeFunction implements NodeFunction {

    private final String functionId;
    private final NodeFunction delegate;
    private final NodeGovernance governance;

    @Override
    public Object process(UpstreamInput input) throws Exception {
        int maxRetries = governance != null ? governance.getMaxRetries() : 0;
        long backoff = governance != null ? governance.getRetryBackoff() : 0;

        int attempt = 0;
        Exception lastException = null;

        while (attempt <= maxRetries) {
            try {
                return delegate.process(input);
            } catch (Exception e) {
                lastException = e;
                attempt++;
                if (attempt <= maxRetries) {
                    log.warn("Function [{}] failed (attempt {}/{}), retrying...", functionId, attempt, maxRetries);
                    if (backoff > 0) {
                        try {
                            Thread.sleep(backoff);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw ie;
                        }
                    }
                }
            }
        }

        FallbackStrategy fallback = governance != null ? governance.getFallbackStrategy() : null;
        if (fallback != null) {
            log.warn("Function [{}] failed after {} retries, triggering fallback. Cause: {}",
                    functionId, maxRetries, lastException.getMessage());
            return fallback.fallback(functionId, input, lastException);
        }
        log.error("Function [{}] failed after {} retries.", functionId, maxRetries);
        throw lastException;
    }

    @Override
    public String name() {
        return delegate.name();
    }
}
