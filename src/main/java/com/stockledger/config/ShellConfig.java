package com.stockledger.config;

import com.stockledger.shell.ShellConsole;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "inventory.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShellConfig {

    // main() registers its console before the context starts; this covers launches that bypass it
    @Bean
    @ConditionalOnMissingBean
    ShellConsole shellConsole() {
        return ShellConsole.overSystemStreams();
    }
}
