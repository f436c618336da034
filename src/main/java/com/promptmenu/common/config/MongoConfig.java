package com.promptmenu.common.config;

import com.promptmenu.order.entity.OrderStatus;
import com.promptmenu.review.entity.ReviewStatus;
import org.bson.types.Decimal128;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB 클라이언트 설정.
 *
 * <h3>역할</h3>
 * 연결/소켓 타임아웃을 promptmenu.mongo.timeout(기본 30초)으로 맞추고,
 * 모든 타임스탬프가 사용하는 UTC {@link Clock}을 등록한다.
 * 상태 enum은 이름(PENDING)이 아니라 소문자 값(pending)으로 저장하고,
 * 금액/평점(BigDecimal)은 문자열이 아닌 Decimal128 숫자로 저장한다.
 *
 * <h3>트랜잭션</h3>
 * 읽기-계산-쓰기는 트랜잭션 없이 수행된다. 문서 단위 @Version 낙관적 락과
 * $inc 원자 연산으로 동시 수정을 처리한다.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer mongoTimeoutCustomizer(PromptMenuProperties properties) {
        int timeoutMillis = Math.toIntExact(properties.mongo().timeout().toMillis());
        return builder -> builder
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalWriter(), new BigDecimalReader(),
                new OrderStatusWriter(), new OrderStatusReader(),
                new ReviewStatusWriter(), new ReviewStatusReader()));
    }

    @WritingConverter
    static class BigDecimalWriter implements Converter<BigDecimal, Decimal128> {
        @Override
        public Decimal128 convert(BigDecimal source) {
            return new Decimal128(source);
        }
    }

    @ReadingConverter
    static class BigDecimalReader implements Converter<Decimal128, BigDecimal> {
        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }

    @WritingConverter
    static class OrderStatusWriter implements Converter<OrderStatus, String> {
        @Override
        public String convert(OrderStatus source) {
            return source.value();
        }
    }

    @ReadingConverter
    static class OrderStatusReader implements Converter<String, OrderStatus> {
        @Override
        public OrderStatus convert(String source) {
            return OrderStatus.from(source);
        }
    }

    @WritingConverter
    static class ReviewStatusWriter implements Converter<ReviewStatus, String> {
        @Override
        public String convert(ReviewStatus source) {
            return source.value();
        }
    }

    @ReadingConverter
    static class ReviewStatusReader implements Converter<String, ReviewStatus> {
        @Override
        public ReviewStatus convert(String source) {
            return ReviewStatus.from(source);
        }
    }
}
