package org.nowstart.perpbot.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import java.util.Collection;
import org.junit.jupiter.api.Test;

class BearerTokenRequestInterceptorTest {

    @Test
    void apply_addsBearerHeaderWhenKeyPresent() {
        RequestTemplate template = new RequestTemplate();

        new BearerTokenRequestInterceptor("secret-key").apply(template);

        assertThat(header(template, "Authorization")).containsExactly("Bearer secret-key");
        assertThat(header(template, "Accept")).containsExactly("application/json");
    }

    @Test
    void apply_blankKey_omitsAuthorization() {
        RequestTemplate template = new RequestTemplate();

        new BearerTokenRequestInterceptor(" ").apply(template);

        assertThat(template.headers()).doesNotContainKey("Authorization");
        assertThat(header(template, "User-Agent")).containsExactly("perpbot/1.0");
    }

    private static Collection<String> header(RequestTemplate template, String name) {
        return template.headers().get(name);
    }
}
