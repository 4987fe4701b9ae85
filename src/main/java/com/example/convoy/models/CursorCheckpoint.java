package com.example.convoy.models;

import java.util.Date;

import org.bson.Document;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = {"feedName"})
@ToString
public class CursorCheckpoint {

    private String feedName;
    private String cursor;
    private Date date;
    private String appName;

    public Document toDocument() {
        return new Document().append("feedName", feedName)
                .append("cursor", cursor)
                .append("date", date)
                .append("appName", appName);
    }

    public static CursorCheckpoint fromDocument(Document document) {
        return new CursorCheckpoint(document.getString("feedName"), document.getString("cursor"),
                document.getDate("date"), document.getString("appName"));
    }
}
