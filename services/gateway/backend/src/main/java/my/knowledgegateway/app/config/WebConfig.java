package my.knowledgegateway.app.config;

import my.knowledgegateway.app.api.RemoteSourceInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
	private final RemoteSourceInterceptor remoteSourceInterceptor;

	public WebConfig(RemoteSourceInterceptor remoteSourceInterceptor) {
		this.remoteSourceInterceptor = remoteSourceInterceptor;
	}

	@Override
	public void addInterceptors(InterceptorRegistry registry) {
		registry.addInterceptor(remoteSourceInterceptor).addPathPatterns("/assets", "/assets/**");
	}
}
