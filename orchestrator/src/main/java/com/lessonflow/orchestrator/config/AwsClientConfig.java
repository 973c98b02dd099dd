package com.lessonflow.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.lambda.LambdaClient;

import java.net.URI;
import java.time.Duration;

/**
 * AWS 클라이언트 설정 (DynamoDB, Lambda)
 *
 * 자격 증명은 DefaultCredentialsProvider 체인(환경 변수, 프로파일, IAM Role) 사용.
 * endpoint-url이 있으면 LocalStack 등으로 override.
 */
@Configuration
public class AwsClientConfig {

    @Value("${aws.region}")
    private String region;

    @Value("${aws.dynamodb.endpoint-url:#{null}}")
    private String dynamoDbEndpointUrl;

    @Value("${aws.lambda.endpoint-url:#{null}}")
    private String lambdaEndpointUrl;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        var builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .httpClient(ApacheHttpClient.builder()
                        .connectionTimeout(Duration.ofSeconds(5))
                        .build());

        if (dynamoDbEndpointUrl != null && !dynamoDbEndpointUrl.isEmpty()) {
            builder.endpointOverride(URI.create(dynamoDbEndpointUrl));
        }

        return builder.build();
    }

    /**
     * Enhanced Client 기본 확장에 VersionedRecordExtension 포함
     * (@DynamoDbVersionAttribute 조건부 쓰기)
     */
    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public LambdaClient lambdaClient() {
        // 모듈 생성 Lambda는 수십 초 걸릴 수 있음
        SdkHttpClient httpClient = ApacheHttpClient.builder()
                .socketTimeout(Duration.ofSeconds(150))
                .connectionTimeout(Duration.ofSeconds(30))
                .build();

        // 재시도하면 모듈이 중복 생성될 수 있어 비활성화
        ClientOverrideConfiguration clientConfig = ClientOverrideConfiguration.builder()
                .retryPolicy(RetryPolicy.none())
                .apiCallTimeout(Duration.ofSeconds(150))
                .build();

        var builder = LambdaClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .httpClient(httpClient)
                .overrideConfiguration(clientConfig);

        if (lambdaEndpointUrl != null && !lambdaEndpointUrl.isEmpty()) {
            builder.endpointOverride(URI.create(lambdaEndpointUrl));
        }

        return builder.build();
    }
}
