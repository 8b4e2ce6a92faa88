package org.harmar.kv.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class KvJsonTest {

  @Test
  void readsEachRequestKind() throws Exception {
    assertEquals(KvRequest.set("hello", "world"),
        KvJson.readRequest("{\"op\":\"set\",\"key\":\"hello\",\"value\":\"world\"}"));
    assertEquals(KvRequest.get("hello"), KvJson.readRequest("{\"op\":\"get\",\"key\":\"hello\"}"));
    assertEquals(KvRequest.delete("hello"), KvJson.readRequest("{\"op\":\"delete\",\"key\":\"hello\"}"));
  }

  @Test
  void operationNameIsCaseInsensitive() throws Exception {
    assertEquals(KvRequest.get("k"), KvJson.readRequest("{\"op\":\"GET\",\"key\":\"k\"}"));
  }

  @Test
  void extraFieldsAreIgnored() throws Exception {
    assertEquals(KvRequest.get("k"), KvJson.readRequest("{\"op\":\"get\",\"key\":\"k\",\"value\":\"ignored\",\"x\":1}"));
  }

  @Test
  void writesRequestsInWireForm() {
    assertEquals("{\"op\":\"set\",\"key\":\"a\",\"value\":\"b\"}", KvJson.writeRequest(KvRequest.set("a", "b")));
    assertEquals("{\"op\":\"delete\",\"key\":\"a\"}", KvJson.writeRequest(KvRequest.delete("a")));
  }

  @Test
  void getResponseCarriesValueOrNull() throws Exception {
    assertEquals("{\"op\":\"get\",\"value\":\"world\"}", KvJson.writeResponse(KvResponse.get(Optional.of("world"))));
    assertEquals("{\"op\":\"get\",\"value\":null}", KvJson.writeResponse(KvResponse.get(Optional.empty())));
    assertEquals("{\"op\":\"set\"}", KvJson.writeResponse(KvResponse.set()));

    assertEquals(Optional.of("world"), KvJson.readResponse("{\"op\":\"get\",\"value\":\"world\"}").getValue());
    assertEquals(Optional.empty(), KvJson.readResponse("{\"op\":\"get\",\"value\":null}").getValue());
    assertEquals(Optional.empty(), KvJson.readResponse("{\"op\":\"get\"}").getValue());
  }

  @Test
  void valuesWithSpecialCharactersSurviveEncoding() throws Exception {
    String value = "line1\nline2 \"quoted\" é";
    String line = KvJson.writeRequest(KvRequest.set("k", value));

    assertEquals(-1, line.indexOf('\n'));
    assertEquals(value, KvJson.readRequest(line).getValue());
  }

  @Test
  void rejectsMalformedRequests() {
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("not json"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest(""));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("[1,2]"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"key\":\"k\"}"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"incr\",\"key\":\"k\"}"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"get\"}"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"get\",\"key\":5}"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"set\",\"key\":\"k\"}"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"set\",\"key\":\"k\",\"value\":null}"));
  }

  @Test
  void rejectsMalformedResponses() {
    assertThrows(ProtocolException.class, () -> KvJson.readResponse("{\"op\":\"get\",\"value\":3}"));
    assertThrows(ProtocolException.class, () -> KvJson.readResponse("{}"));
  }

  @Test
  void rejectsTrailingContentAfterObject() {
    assertThrows(ProtocolException.class,
        () -> KvJson.readRequest("{\"op\":\"set\",\"key\":\"t\",\"value\":\"v\"} trailing junk"));
    assertThrows(ProtocolException.class, () -> KvJson.readRequest("{\"op\":\"get\",\"key\":\"k\"}{}"));
    assertThrows(ProtocolException.class, () -> KvJson.readResponse("{\"op\":\"set\"} 1"));
  }
}
