package io.github.cyfko.querier.spring.web;

import io.github.cyfko.querier.core.binding.QuerierParamsBinder;
import io.github.cyfko.querier.core.model.QuerierParams;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

import java.lang.reflect.Method;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QuerierParamsArgumentResolverTest {

    private final QuerierParamsArgumentResolver resolver = new QuerierParamsArgumentResolver(new QuerierParamsBinder());

    @SuppressWarnings("unused")
    void handler(QuerierParams params, String other) {
    }

    private MethodParameter parameter(int index) throws NoSuchMethodException {
        Method method = getClass().getDeclaredMethod("handler", QuerierParams.class, String.class);
        return new MethodParameter(method, index);
    }

    @Test
    void shouldSupportOnlyQuerierParams() throws Exception {
        assertTrue(resolver.supportsParameter(parameter(0)));
        assertFalse(resolver.supportsParameter(parameter(1)));
    }

    @Test
    void shouldBindQueryString() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/companies");
        request.addParameter("q", "acme");
        request.addParameter("filter[status]", "active");
        request.addParameter("filter[revenue][gte]", "1000");
        request.addParameter("sort", "-createdAt");
        request.addParameter("page", "2");
        request.addParameter("pageSize", "abc");

        QuerierParams params = resolver.resolveArgument(parameter(0), null, new ServletWebRequest(request), null);

        assertEquals("acme", params.freeText());
        assertEquals(Map.of("eq", "active"), params.filters().get("status"));
        assertEquals(Map.of("gte", "1000"), params.filters().get("revenue"));
        assertEquals("-createdAt", params.sort());
        assertEquals(2, params.page());
        assertEquals(20, params.pageSize());
    }
}
