package org.iceforge.ullr;

import org.iceforge.ullr.aws.UllrAwsProperties;
import org.iceforge.ullr.insights.InsightsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({UllrAwsProperties.class, InsightsProperties.class})
public class UllrApplication {

	public static void main(String[] args) {
		SpringApplication.run(UllrApplication.class, args);
	}
}
