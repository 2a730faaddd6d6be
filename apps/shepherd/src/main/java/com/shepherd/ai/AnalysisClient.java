package com.shepherd.ai;

import com.shepherd.api.dto.AnalysisRequest;
import com.shepherd.api.dto.Verdict;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 抽象的分析网关接口。
 *
 * 调用方只面向这个接口，不关心背后是本地 CLI 还是 Spring AI 的 ChatModel。
 * 一次调用对应一轮分析：规则 + 上下文快照 → 零个或多个 Verdict。
 *
 * 失败（超时、格式错误、鉴权/配额、进程失败）以
 * {@link com.shepherd.error.AnalysisServiceException} 的错误信号结束 Mono；
 * 调用方把这一轮当作空操作。
 */
public interface AnalysisClient {

    Mono<List<Verdict>> analyze(AnalysisRequest request);

    /**
     * 启动前的可用性检查，成功时给出一行后端描述（例如版本号）。
     * 默认不做任何调用。
     */
    default Mono<String> checkReady() {
        return Mono.just("ready");
    }
}
