package com.ospicorp.tstoolbox.config;

import com.ospicorp.tstoolbox.series.io.CsvHttpMessageConverter;
import com.ospicorp.tstoolbox.series.io.TimeSeriesCsvCodec;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter(timeSeriesCsvCodec()));
  }

  @Bean
  TimeSeriesCsvCodec timeSeriesCsvCodec() {
    return new TimeSeriesCsvCodec();
  }
}
