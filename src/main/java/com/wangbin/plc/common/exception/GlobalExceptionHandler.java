package com.wangbin.plc.common.exception;

import com.wangbin.plc.common.web.result.ApiResult;
import com.wangbin.plc.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理采集器异常（配置、网络、协议数据）
     */
    @ExceptionHandler(CollectorException.class)
    public ApiResult<?> handleCollectorException(CollectorException e, HttpServletRequest request) {
        if (e instanceof ConfigurationException) {
            log.warn("配置错误 - Device: {}, Address: {}: {}", e.getDeviceId(), e.getAddress(), e.getMessage());
        } else {
            log.error("采集器异常 - Device: {}, Address: {}, Quality: {}: {}",
                    e.getDeviceId(), e.getAddress(), e.getDataQuality(), e.getMessage());
        }

        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("deviceId", e.getDeviceId());
        result.addExtra("address", e.getAddress());
        result.addExtra("dataQuality", e.getDataQuality().getCode());
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage());
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数校验异常
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResult<?> handleMethodArgumentNotValidException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        String message = joinFieldErrors(e.getBindingResult().getFieldErrors());
        log.error("参数校验异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理绑定异常
     */
    @ExceptionHandler(BindException.class)
    public ApiResult<?> handleBindException(BindException e, HttpServletRequest request) {
        String message = joinFieldErrors(e.getBindingResult().getFieldErrors());
        log.error("参数绑定异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理约束违反异常
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ApiResult<?> handleConstraintViolationException(ConstraintViolationException e,
                                                           HttpServletRequest request) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.joining("; "));
        log.error("约束违反异常: {}", message);
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), message);
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}", request.getRequestURI(), request.getMethod(),
                e.getMessage(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), "系统内部错误: " + e.getMessage());
    }

    private String joinFieldErrors(List<FieldError> fieldErrors) {
        return fieldErrors.stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
    }
}
