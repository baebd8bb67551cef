package net.keygate.web;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@Import({
        CredentialController.class,
        SlotController.class,
        ProductController.class,
        HandoffController.class,
        StatsController.class,
        KeygateExceptionHandler.class
})
public class KeygateWebAutoConfiguration {
}
