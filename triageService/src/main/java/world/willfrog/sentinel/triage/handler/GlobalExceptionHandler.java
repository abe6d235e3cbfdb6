package world.willfrog.sentinel.triage.handler;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import world.willfrog.sentinel.common.dto.ResponseCode;
import world.willfrog.sentinel.common.dto.ResponseWrapper;
import world.willfrog.sentinel.triage.exception.BizException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BizException.class)
    public ResponseWrapper<Void> handleBizException(BizException ex) {
        log.warn("Business error: code={}, message={}", ex.getCode(), ex.getMessage());
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseWrapper<Void> handleArgumentNotValid(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError == null ? "Invalid request" : fieldError.getDefaultMessage();
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseWrapper<Void> handleValidations(Exception ex) {
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseWrapper<Void> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseWrapper.error(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }
}
