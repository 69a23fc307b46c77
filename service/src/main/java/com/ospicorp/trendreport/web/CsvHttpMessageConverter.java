package com.ospicorp.trendreport.web;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.ospicorp.trendreport.report.CsvTables;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Renders collections of rows (maps or beans) as {@code text/csv}. Write-only. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  private static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = CsvTables.newMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz) || Object[].class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Iterable<?> rows = object instanceof Collection<?> collection
        ? collection
        : Arrays.asList((Object[]) object);
    CsvTables.write(mapper, rows, outputMessage.getBody());
  }
}
