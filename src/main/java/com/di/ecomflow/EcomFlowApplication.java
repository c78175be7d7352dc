package com.di.ecomflow;

import com.di.ecomflow.config.PipelineProperties;
import com.di.ecomflow.runner.EtlPipelineService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableAspectJAutoProxy(proxyTargetClass = false)
@ConfigurationPropertiesScan
public class EcomFlowApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(EcomFlowApplication.class, args);
		// The API stays up after the startup run; POST /api/pipeline/run triggers further runs.
		if (ctx.getBean(PipelineProperties.class).isRunOnStartup()) {
			ctx.getBean(EtlPipelineService.class).runPipeline();
		}
	}
}
