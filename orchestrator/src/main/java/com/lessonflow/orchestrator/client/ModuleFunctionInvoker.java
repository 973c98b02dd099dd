package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

/**
 * 모듈 생성 Lambda 동기 호출 (createPredefinedModule, alias 지정)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModuleFunctionInvoker {

    private static final String SERVICE = "module-function";

    private final LambdaClient lambdaClient;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;

    /**
     * @return 함수가 돌려준 {statusCode, body}
     * @throws ExternalCallException functionError, SDK 오류, 응답 파싱 실패
     */
    public FunctionResult invoke(Object payload) {
        LessonflowProperties.ModuleFunction function = properties.getModuleFunction();
        log.info("Lambda 호출 시작: function={}, alias={}", function.getFunctionName(), function.getAlias());

        try {
            // 1. 요청 생성
            InvokeRequest invokeRequest = InvokeRequest.builder()
                    .functionName(function.getFunctionName())
                    .qualifier(function.getAlias())
                    .invocationType(InvocationType.REQUEST_RESPONSE)
                    .payload(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            // 2. 동기 호출
            InvokeResponse invokeResponse = lambdaClient.invoke(invokeRequest);

            // 3. 응답 파싱 (오류 포함)
            String responsePayload = invokeResponse.payload().asUtf8String();
            log.debug("Lambda response: {}", responsePayload);

            if (invokeResponse.functionError() != null) {
                log.error("Lambda 실행 오류: {}", responsePayload);
                throw new ExternalCallException(SERVICE, invokeResponse.statusCode(),
                        invokeResponse.functionError() + ": " + responsePayload);
            }

            JsonNode result = objectMapper.readTree(responsePayload);
            if (!result.path("statusCode").canConvertToInt()) {
                throw new ExternalCallException(SERVICE, invokeResponse.statusCode(),
                        "statusCode 없는 응답: " + responsePayload);
            }

            FunctionResult functionResult = new FunctionResult(result.path("statusCode").intValue(), result.get("body"));
            log.info("Lambda 호출 완료: statusCode={}", functionResult.statusCode());
            return functionResult;

        } catch (ExternalCallException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ExternalCallException(SERVICE, "payload 직렬화/응답 파싱 실패", e);
        } catch (SdkException e) {
            log.error("Lambda 호출 실패 (timeout 또는 연결 오류)", e);
            throw new ExternalCallException(SERVICE, "invocation failed: " + e.getMessage(), e);
        }
    }
}
