package com.stockledger;

import com.stockledger.shell.ConnectionPrompt;
import com.stockledger.shell.ShellConsole;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StockLedgerApplication {

	public static void main(String[] args) {
		// One console for the connection prompt and the menu, so lines buffered from stdin are not lost
		ShellConsole console = ShellConsole.overSystemStreams();
		if (ConnectionPrompt.isRequested(args)) {
			args = ConnectionPrompt.ask(console, args);
		}
		SpringApplication application = new SpringApplication(StockLedgerApplication.class);
		application.addInitializers(context -> context.getBeanFactory().registerSingleton("shellConsole", console));
		application.run(args);
	}

}
