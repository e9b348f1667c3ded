package io.github.cyfko.querier.spring.autoconfigure;

import io.github.cyfko.querier.core.QuerierBuilder;
import io.github.cyfko.querier.core.api.FieldRegistry;
import io.github.cyfko.querier.core.binding.QuerierParamsBinder;
import io.github.cyfko.querier.core.config.QuerierConfig;
import io.github.cyfko.querier.spring.service.QuerierTemplate;
import io.github.cyfko.querier.spring.support.FieldRegistryCatalog;
import io.github.cyfko.querier.spring.web.QuerierExceptionHandler;
import io.github.cyfko.querier.spring.web.QuerierParamsArgumentResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Auto-configuration registering the querier engine beans, plus MVC argument binding and
 * problem responses in servlet applications.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration
@ConditionalOnClass(QuerierBuilder.class)
@EnableConfigurationProperties(QuerierProperties.class)
public class QuerierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public QuerierConfig querierConfig(QuerierProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public QuerierParamsBinder querierParamsBinder(QuerierProperties properties) {
        return new QuerierParamsBinder(properties.getDefaultPageSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldRegistryCatalog fieldRegistryCatalog(ObjectProvider<FieldRegistry<?>> registries) {
        return new FieldRegistryCatalog(registries.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public QuerierTemplate querierTemplate(FieldRegistryCatalog catalog, QuerierConfig config) {
        return new QuerierTemplate(catalog, config);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(WebMvcConfigurer.class)
    static class QuerierWebMvcConfiguration {

        @Bean
        public WebMvcConfigurer querierWebMvcConfigurer(QuerierParamsBinder binder) {
            return new WebMvcConfigurer() {
                @Override
                public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
                    resolvers.add(new QuerierParamsArgumentResolver(binder));
                }
            };
        }

        @Bean
        @ConditionalOnMissingBean
        public QuerierExceptionHandler querierExceptionHandler() {
            return new QuerierExceptionHandler();
        }
    }
}
