package org.showvault.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class PersistenceConfig {

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager, AppProperties appProperties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(appProperties.getShows().getPersistenceTimeoutSeconds());
        return template;
    }
}
