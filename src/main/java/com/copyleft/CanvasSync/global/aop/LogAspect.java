package com.copyleft.CanvasSync.global.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;

/**
 * 서비스 호출 시간 측정. 커서 이벤트처럼 잦은 호출이 많아서 debug 레벨로만 남긴다.
 */
@Slf4j
@Aspect
@Component
public class LogAspect {

    @Pointcut("execution(* com.copyleft.CanvasSync.feature..*Service.*(..))")
    public void serviceLayer() {}

    @Around("serviceLayer()")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint) throws Throwable {
        if (!log.isDebugEnabled()) {
            return joinPoint.proceed();
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();

        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        log.debug("▶ [START] {}.{} | Args: {}", className, methodName, Arrays.deepToString(joinPoint.getArgs()));

        Object result = null;
        try {
            result = joinPoint.proceed();
            return result;
        } catch (Throwable e) {
            log.error("🛑 [EXCEPTION] {}.{} | Msg: {}", className, methodName, e.getMessage(), e);
            throw e;
        } finally {
            if (stopWatch.isRunning()) {
                stopWatch.stop();
            }
            log.debug("◀ [END] {}.{} | Result: {} | Time: {}ms",
                    className, methodName, result, stopWatch.getTotalTimeMillis());
        }
    }
}
