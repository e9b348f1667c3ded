package io.github.cyfko.querier.spring.web;

import io.github.cyfko.querier.core.binding.QuerierParamsBinder;
import io.github.cyfko.querier.core.model.QuerierParams;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Binds the query string of a request into controller parameters of type {@link QuerierParams}.
 *
 * @author Frank KOSSI
 */
public class QuerierParamsArgumentResolver implements HandlerMethodArgumentResolver {

    private final QuerierParamsBinder binder;

    public QuerierParamsArgumentResolver(QuerierParamsBinder binder) {
        this.binder = binder;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return QuerierParams.class.equals(parameter.getParameterType());
    }

    @Override
    public QuerierParams resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return binder.bind(webRequest.getParameterMap());
    }
}
