package com.healthassist.config;

import com.healthassist.common.Result;
import com.healthassist.common.exception.AnalysisFailedException;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 对外只返回统一的 Result 错误体，不返回任何部分分析结果
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_ERROR = "Error analyzing symptom. Please try again later.";

    /**
     * 处理参数校验失败（返回400）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        log.warn("参数校验失败: {}", message);
        return Result.error(400, message);
    }

    /**
     * 处理请求体无法解析（返回400）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("请求体解析失败: {}", e.getMessage());
        return Result.error(400, "Malformed request body");
    }

    /**
     * 处理参数异常（返回400）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("参数错误: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 处理 MVC 路由类异常（未知路径、不支持的方法等），保留框架给出的状态码
     */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<Result<Object>> handleServletException(ServletException e) {
        HttpStatusCode status = e instanceof ErrorResponse
                ? ((ErrorResponse) e).getStatusCode() : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("请求处理异常", e);
            return ResponseEntity.status(status).body(Result.error(status.value(), GENERIC_ERROR));
        }
        log.warn("请求无法处理: {}", e.getMessage());
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = resolved != null ? resolved.getReasonPhrase() : "Request could not be handled";
        return ResponseEntity.status(status).body(Result.error(status.value(), message));
    }

    /**
     * 处理分析失败（内部细节已在服务层记录）
     */
    @ExceptionHandler(AnalysisFailedException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<Object> handleAnalysisFailed(AnalysisFailedException e) {
        return Result.error(500, e.getMessage());
    }

    /**
     * 处理所有异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<Object> handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(500, GENERIC_ERROR);
    }
}
