/*
 * どこで: Newsletter サービス補助
 * 何を: ResponseEntity と保存用の (status, 順序付きヘッダ, body) を相互変換する
 * なぜ: 冪等テーブルへ確定レスポンスを保存し、再送時にバイト単位で同じ応答を返すため
 */
package com.example.newsletter.service;

import com.example.newsletter.api.ResponseCaptureException;
import com.example.newsletter.config.NewsletterIdempotencyProperties;
import com.example.newsletter.model.CapturedResponse;
import com.example.newsletter.model.HeaderPair;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * レスポンスの保存と再構築を行う。
 *
 * <p>本文はストリームも含めて全量をメモリへ読み切ってから保存する。上限は
 * {@code newsletter.idempotency.max-response-body-size} で、超える応答(大きなファイル配信など)は
 * {@link ResponseCaptureException} で拒否されるため、この仕組みの対象にしないこと。
 */
@Component
public class ResponseCapture {

  private final ObjectMapper objectMapper;
  private final long maxBodyBytes;

  @Autowired
  public ResponseCapture(ObjectMapper objectMapper, NewsletterIdempotencyProperties properties) {
    this(objectMapper, properties.maxResponseBodySize().toBytes());
  }

  @VisibleForTesting
  ResponseCapture(ObjectMapper objectMapper, long maxBodyBytes) {
    this.objectMapper = objectMapper;
    this.maxBodyBytes = maxBodyBytes;
  }

  public CapturedResponse capture(ResponseEntity<?> response) {
    final List<HeaderPair> headers = new ArrayList<>();
    // HttpHeaders は名前ごとに値の順序と重複を保持しているので、その順で平坦化する。
    response.getHeaders().forEach(
        (name, values) -> values.forEach(value -> headers.add(HeaderPair.of(name, value))));
    final Object body = response.getBody();
    final byte[] bytes = drain(body, response.getHeaders().getContentType());
    if (isSerializedObject(body) && response.getHeaders().getContentType() == null) {
      // 再生時は byte[] として書き出すため、JSON 化した型付き本文の Content-Type を固定しておく。
      headers.add(HeaderPair.of(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE));
    }
    return new CapturedResponse(response.getStatusCode().value(), headers, bytes);
  }

  public ResponseEntity<byte[]> reconstruct(CapturedResponse captured) {
    final HttpHeaders headers = new HttpHeaders();
    for (HeaderPair header : captured.headers()) {
      headers.add(header.name(), header.valueAsString());
    }
    return ResponseEntity.status(HttpStatusCode.valueOf(captured.statusCode()))
        .headers(headers)
        .body(captured.body());
  }

  private byte[] drain(Object body, MediaType contentType) {
    if (body == null) {
      return new byte[0];
    }
    final BoundedBuffer buffer = new BoundedBuffer(maxBodyBytes);
    try {
      if (body instanceof byte[] bytes) {
        buffer.write(bytes);
      } else if (body instanceof CharSequence text) {
        buffer.write(text.toString().getBytes(resolveCharset(contentType)));
      } else if (body instanceof Resource resource) {
        try (InputStream in = resource.getInputStream()) {
          in.transferTo(buffer);
        }
      } else if (body instanceof StreamingResponseBody streaming) {
        streaming.writeTo(buffer);
      } else {
        objectMapper.writeValue(buffer, body);
      }
    } catch (BodyTooLargeException ex) {
      throw bodyTooLarge(ex);
    } catch (JsonProcessingException ex) {
      // Jackson は書き込み先の例外を JsonMappingException に包むことがある。
      if (Throwables.getRootCause(ex) instanceof BodyTooLargeException) {
        throw bodyTooLarge(ex);
      }
      throw new ResponseCaptureException("failed to serialize response body", ex);
    } catch (IOException ex) {
      if (Throwables.getRootCause(ex) instanceof BodyTooLargeException) {
        throw bodyTooLarge(ex);
      }
      throw new ResponseCaptureException("failed to read response body", ex);
    }
    return buffer.toByteArray();
  }

  private ResponseCaptureException bodyTooLarge(Exception cause) {
    return new ResponseCaptureException(
        "response body exceeds " + maxBodyBytes + " bytes and cannot be stored", cause);
  }

  private boolean isSerializedObject(Object body) {
    return body != null
        && !(body instanceof byte[])
        && !(body instanceof CharSequence)
        && !(body instanceof Resource)
        && !(body instanceof StreamingResponseBody);
  }

  private Charset resolveCharset(MediaType contentType) {
    if (contentType == null || contentType.getCharset() == null) {
      return StandardCharsets.UTF_8;
    }
    return contentType.getCharset();
  }

  private static final class BoundedBuffer extends ByteArrayOutputStream {

    private final long limit;

    private BoundedBuffer(long limit) {
      this.limit = limit;
    }

    @Override
    public synchronized void write(int b) {
      ensureCapacity(1);
      super.write(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
      ensureCapacity(len);
      super.write(b, off, len);
    }

    private void ensureCapacity(int additional) {
      if ((long) count + additional > limit) {
        throw new BodyTooLargeException();
      }
    }
  }

  private static final class BodyTooLargeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private BodyTooLargeException() {
      super(null, null, false, false);
    }
  }
}
